package com.apflow.invoice.reference.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST endpoint for tool calls: POST /api/tools/{toolName} with a JSON
 * argument document, answered with the tool's JSON result.
 */
@RestController
@RequestMapping("/api/tools")
public class ReferenceToolController {

    private static final Logger log = LoggerFactory.getLogger(ReferenceToolController.class);

    private final ToolDispatcher dispatcher;

    public ReferenceToolController(ToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(value = "/{toolName}", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> callTool(@PathVariable String toolName,
                                           @RequestBody(required = false) String arguments) {
        try {
            return ResponseEntity.ok(dispatcher.dispatch(toolName, arguments));
        } catch (UnknownToolException e) {
            log.warn("Unknown tool requested - tool={}", toolName);
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected tool call - tool={}, reason={}", toolName, e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Tool call failed - tool={}", toolName, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}

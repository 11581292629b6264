package com.apflow.invoice.reference.data;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the reference data file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceDataSet {
    private List<Supplier> suppliers = new ArrayList<>();
    private List<PurchaseOrder> purchaseOrders = new ArrayList<>();
}

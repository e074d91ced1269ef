package com.vendoretl.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.List;

/**
 * One page of raw vendor JSON plus the cursor of the page after it ({@code null} on the last page).
 */
@Value
public class VendorPage {
    String cityId;
    String cursor;
    List<JsonNode> vendors;
    String nextCursor;

    public boolean hasNext() {
        return nextCursor != null;
    }
}

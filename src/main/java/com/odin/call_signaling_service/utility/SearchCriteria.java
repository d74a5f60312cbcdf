package com.odin.call_signaling_service.utility;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter clause understood by the core service's details endpoint.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SearchCriteria {

    private String key;
    private String operation;
    private Object value;
    private String condition; // "AND" / "OR", empty for the first clause
}

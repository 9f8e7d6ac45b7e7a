package com.madisonmentions.backend.analysis.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class OutletChange {
    private boolean changed;
    private String note;

    public static OutletChange none() {
        return new OutletChange(false, null);
    }

    public static OutletChange detected(String previousOutlet, String currentOutlet) {
        return new OutletChange(true,
                String.format("Possible outlet change: Previously %s, now %s", previousOutlet, currentOutlet));
    }
}

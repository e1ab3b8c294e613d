package com.dcarunner.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Delegated application the job runs under, and the permitted version recorded for it.
 * {@code version} only ever advances (to the user's live permitted version).
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class AppReference {

    private String appId;
    private int version;
}

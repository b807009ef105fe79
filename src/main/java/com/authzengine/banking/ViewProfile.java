package com.authzengine.banking;

import lombok.Value;

/**
 * Request to view a customer profile. No rules guard it.
 */
@Value
public class ViewProfile {
    String profileId;
}

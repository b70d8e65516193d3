package com.optionscalper.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UserProfile {

    String userId;
    String userName;
}

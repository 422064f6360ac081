package com.portfoliosync.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class UserProfile {

    private final String userId;
    private final String userName;
    private final String email;
}

package com.eventaudit.domain.model;

import lombok.Value;

@Value
public class CheckFailure {
    String checkName;
    String error;
}

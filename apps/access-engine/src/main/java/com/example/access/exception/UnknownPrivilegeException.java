package com.example.access.exception;

import lombok.Getter;

// A privilege code was used where a catalog code is required.
@Getter
public class UnknownPrivilegeException extends PolicyConfigurationException {

    private final String privilegeCode;

    public UnknownPrivilegeException(String privilegeCode) {
        super("Unknown privilege code: " + privilegeCode);
        this.privilegeCode = privilegeCode;
    }

    public UnknownPrivilegeException(String message, String privilegeCode) {
        super(message);
        this.privilegeCode = privilegeCode;
    }
}

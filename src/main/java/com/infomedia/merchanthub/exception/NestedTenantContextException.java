package com.infomedia.merchanthub.exception;

/**
 * Raised when a unit of work tries to switch to a second tenant while another one is active.
 * Indicates an integration bug.
 */
public class NestedTenantContextException extends IllegalStateException {

    public NestedTenantContextException(String activeTenant, String requestedTenant) {
        super("Cannot enter tenant context '" + requestedTenant + "' while tenant '" + activeTenant + "' is active");
    }
}

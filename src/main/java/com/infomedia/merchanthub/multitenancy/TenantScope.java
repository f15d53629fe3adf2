package com.infomedia.merchanthub.multitenancy;

/**
 * An entered tenant context. Closing it restores the central context; a scope that joined an
 * already active context of the same tenant leaves it untouched on close.
 */
public final class TenantScope implements AutoCloseable {

    private final TenantResources resources;
    private final TenantContextManager manager;
    private final boolean owner;
    private final Thread thread;
    private boolean closed;

    TenantScope(TenantResources resources, TenantContextManager manager, boolean owner) {
        this.resources = resources;
        this.manager = manager;
        this.owner = owner;
        this.thread = Thread.currentThread();
    }

    public TenantResources getResources() {
        return resources;
    }

    public String getTenantId() {
        return resources.tenantId();
    }

    public boolean isOwner() {
        return owner;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (Thread.currentThread() != thread) {
            throw new IllegalStateException("Tenant scope of '" + resources.tenantId()
                    + "' must be closed by the thread that entered it");
        }
        closed = true;
        if (owner) {
            manager.exit(this);
        }
    }
}

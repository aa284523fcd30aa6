package com.loom.orchestrator.context;

/**
 * Thrown when a stage writes a context key that another stage already owns.
 */
public class ContextOwnershipException extends RuntimeException {

    private final String key;
    private final String owner;
    private final String writer;

    public ContextOwnershipException(String key, String owner, String writer) {
        super("Context key '%s' is owned by stage '%s' and cannot be written by '%s'"
                .formatted(key, owner, writer));
        this.key    = key;
        this.owner  = owner;
        this.writer = writer;
    }

    public String key()    { return key; }
    public String owner()  { return owner; }
    public String writer() { return writer; }
}

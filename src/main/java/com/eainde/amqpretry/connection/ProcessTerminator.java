package com.eainde.amqpretry.connection;

/**
 * Ends the running process. Replaced in tests.
 */
@FunctionalInterface
public interface ProcessTerminator {

    ProcessTerminator SYSTEM_EXIT = System::exit;

    void terminate(int status);
}

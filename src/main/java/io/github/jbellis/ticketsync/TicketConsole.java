package io.github.jbellis.ticketsync;

/**
 * Where user-facing progress and errors go.
 */
public interface TicketConsole {
    void actionOutput(String msg);

    void toolError(String msg);

    /**
     * Writes progress to stdout and errors to stderr.
     */
    static TicketConsole stdio() {
        return new TicketConsole() {
            @Override
            public void actionOutput(String msg) {
                System.out.println(msg);
            }

            @Override
            public void toolError(String msg) {
                System.err.println(msg);
            }
        };
    }

    static TicketConsole silent() {
        return new TicketConsole() {
            @Override
            public void actionOutput(String msg) {
                // pass
            }

            @Override
            public void toolError(String msg) {
                // pass
            }
        };
    }
}

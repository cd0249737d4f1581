package echoserver;

public enum ServerMode {
    /** Accept and connection I/O share one thread; connections are served one at a time. */
    SINGLE_THREADED,
    /** One worker thread per accepted connection. */
    MULTI_THREADED
}

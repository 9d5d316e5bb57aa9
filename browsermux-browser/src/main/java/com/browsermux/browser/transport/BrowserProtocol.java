package com.browsermux.browser.transport;

/**
 * Method names and envelope fields of the browser's remote-debugging
 * protocol that the relay inspects. Everything else is passed through
 * untouched.
 */
public final class BrowserProtocol {

    private BrowserProtocol() {}

    public static final String CREATE_CONTEXT = "Playwright.createContext";
    public static final String DELETE_CONTEXT = "Playwright.deleteContext";
    public static final String PAGE_PROXY_CREATED = "Playwright.pageProxyCreated";
    public static final String PAGE_PROXY_DESTROYED = "Playwright.pageProxyDestroyed";
    public static final String PROVISIONAL_LOAD_FAILED = "Playwright.provisionalLoadFailed";
    public static final String CLOSE = "Playwright.close";

    /** Id of the graceful close request; its response is never routed. */
    public static final int BROWSER_CLOSE_MESSAGE_ID = -9999;

    // Envelope and param keys
    public static final String ID = "id";
    public static final String METHOD = "method";
    public static final String PARAMS = "params";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String PAGE_PROXY_ID = "pageProxyId";
    public static final String PAGE_PROXY_INFO = "pageProxyInfo";
    public static final String BROWSER_CONTEXT_ID = "browserContextId";
}

package testblocks.selenium;

/** Browsers {@link Browser#launch} can start. */
public enum BrowserType {
    CHROME,
    FIREFOX,
    EDGE
}

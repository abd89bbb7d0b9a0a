package testblocks.service;

/**
 * How long a provided service instance lives.
 */
public enum Lifetime {
    /** One instance per {@link ServiceRegistry}, shared by every run. */
    SINGLETON,
    /** One instance per run, created on first request and disposed when the run ends. */
    SCOPED
}

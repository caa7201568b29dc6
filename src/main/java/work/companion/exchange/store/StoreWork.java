package work.companion.exchange.store;

/**
 * Unit of work executed inside a single store transaction.
 */
@FunctionalInterface
public interface StoreWork<T> {
    T run(StoreGateway store);
}

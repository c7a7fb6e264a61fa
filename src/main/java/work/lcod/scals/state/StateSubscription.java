package work.lcod.scals.state;

/**
 * Handle returned by {@link StateStore#observe}. Closing it stops further notifications.
 */
public interface StateSubscription extends AutoCloseable {
    @Override
    void close();
}

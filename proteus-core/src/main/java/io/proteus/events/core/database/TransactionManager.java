package io.proteus.events.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Scopes store manager calls to a database transaction bound to the calling thread.
 *
 * The {@code Class} arguments name the checked exceptions that {@code func} may throw;
 * they are rethrown as they are and roll the transaction back.
 */
public interface TransactionManager
{
    /**
     * Handle of the transaction bound to the current thread.
     *
     * @throws IllegalStateException if the thread is not in begin or autoCommit
     */
    Handle getHandle(JsonNodeMapper jsonNodeMapper);

    /**
     * Runs func in a new transaction. Commits when func returns, rolls back when it throws.
     * Nesting is not allowed.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func);

    <T, E1 extends Exception> T begin(
            SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
        throws E1;

    <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2, E3> func, Class<E1> e1, Class<E2> e2, Class<E3> e3)
        throws E1, E2, E3;

    /**
     * Runs func in the current transaction if there is one, otherwise on a handle
     * in auto-commit mode.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func);

    <T, E1 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
        throws E1;

    <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, E2, E3> func, Class<E1> e1, Class<E2> e2, Class<E3> e3)
        throws E1, E2, E3;

    @FunctionalInterface
    interface SupplierInTransaction<T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    {
        T get()
                throws E1, E2, E3;
    }
}

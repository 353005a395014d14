package io.proteus.events.core.database;

import com.google.inject.Inject;
import io.proteus.events.core.ThrowablesUtil;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import java.sql.SQLException;

import javax.sql.DataSource;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binds the current transaction to the calling thread so that store managers
 * called from one {@code begin} block share a database handle.
 *
 * Job runner threads and API caller threads each get their own handle. The handle
 * is opened on first use, so a block that never touches a store costs no connection.
 */
public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private final ThreadLocal<BoundTransaction> current = new ThreadLocal<>();
    private final DataSource ds;

    @Inject
    public ThreadLocalTransactionManager(DataSource ds)
    {
        this.ds = checkNotNull(ds);
    }

    private final class BoundTransaction
    {
        private final boolean autoCommitMode;
        private Handle handle;
        private boolean finished;

        BoundTransaction(boolean autoCommitMode)
        {
            this.autoCommitMode = autoCommitMode;
        }

        Handle getHandle(JsonNodeMapper jsonNodeMapper)
        {
            if (finished) {
                throw new IllegalStateException("Transaction is already finished");
            }
            if (handle == null) {
                handle = openHandle(jsonNodeMapper, autoCommitMode);
            }
            return handle;
        }

        void commit()
        {
            if (handle == null || autoCommitMode) {
                finished = true;
                return;
            }
            // PostgreSQL turns COMMIT of a failed transaction into ROLLBACK without an error
            boolean valid;
            try {
                valid = handle.getConnection().isValid(30);
            }
            catch (SQLException ex) {
                throw new TransactionException("Failed to validate connection before commit", ex);
            }
            if (!valid) {
                throw new TransactionException("Transaction is already aborted by the database and can't be committed");
            }
            handle.commit();
            finished = true;
        }

        void abort()
        {
            if (handle != null && !autoCommitMode && !finished) {
                handle.rollback();
            }
            finished = true;
        }

        void close()
        {
            if (handle != null) {
                handle.close();
                handle = null;
            }
        }
    }

    private Handle openHandle(JsonNodeMapper jsonNodeMapper, boolean autoCommitMode)
    {
        Jdbi dbi = Jdbi.create(ds);
        dbi.installPlugin(new SqlObjectPlugin());
        dbi.registerRowMapper(new DatabaseJobStoreManager.StoredJobMapper(jsonNodeMapper, new StringListMapper()));
        dbi.registerRowMapper(new DatabaseTaskStoreManager.StoredTaskMapper(jsonNodeMapper));
        dbi.registerArgument(jsonNodeMapper.getArgumentFactory());

        Handle handle = dbi.open();
        if (!autoCommitMode) {
            // jdbi turns auto commit off here and back on at commit or rollback
            handle.begin();
            return handle;
        }
        try {
            handle.getConnection().setAutoCommit(true);
        }
        catch (SQLException ex) {
            handle.close();
            throw new TransactionException("Failed to enable auto commit", ex);
        }
        return handle;
    }

    @Override
    public Handle getHandle(JsonNodeMapper jsonNodeMapper)
    {
        BoundTransaction transaction = current.get();
        if (transaction == null) {
            throw new IllegalStateException("Not in transaction");
        }
        return transaction.getHandle(jsonNodeMapper);
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return begin(func, RuntimeException.class, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T begin(SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        return begin(func, e1, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2, E3> func, Class<E1> e1, Class<E2> e2, Class<E3> e3)
            throws E1, E2, E3
    {
        BoundTransaction outer = current.get();
        if (outer != null && !outer.autoCommitMode) {
            throw new IllegalStateException("Nested transaction is not allowed");
        }

        BoundTransaction transaction = new BoundTransaction(false);
        current.set(transaction);
        try {
            T result = func.get();
            transaction.commit();
            return result;
        }
        catch (Exception ex) {
            throw rethrow(ex, e1, e2, e3);
        }
        finally {
            restore(outer);
            try {
                transaction.abort();
            }
            finally {
                transaction.close();
            }
        }
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func)
    {
        return autoCommit(func, RuntimeException.class, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T autoCommit(SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        return autoCommit(func, e1, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    T autoCommit(SupplierInTransaction<T, E1, E2, E3> func, Class<E1> e1, Class<E2> e2, Class<E3> e3)
            throws E1, E2, E3
    {
        BoundTransaction outer = current.get();
        BoundTransaction transaction = null;
        if (outer == null) {
            transaction = new BoundTransaction(true);
            current.set(transaction);
        }
        try {
            return func.get();
        }
        catch (Exception ex) {
            throw rethrow(ex, e1, e2, e3);
        }
        finally {
            if (transaction != null) {
                restore(outer);
                transaction.close();
            }
        }
    }

    private void restore(BoundTransaction outer)
    {
        if (outer == null) {
            current.remove();
        }
        else {
            current.set(outer);
        }
    }

    private static <E1 extends Exception, E2 extends Exception, E3 extends Exception>
    RuntimeException rethrow(Exception ex, Class<E1> e1, Class<E2> e2, Class<E3> e3)
            throws E1, E2, E3
    {
        ThrowablesUtil.propagateIfInstanceOf(ex, e1);
        ThrowablesUtil.propagateIfInstanceOf(ex, e2);
        ThrowablesUtil.propagateIfInstanceOf(ex, e3);
        throw ThrowablesUtil.propagate(ex);
    }
}

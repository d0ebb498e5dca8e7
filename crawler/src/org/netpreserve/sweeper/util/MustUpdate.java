package org.netpreserve.sweeper.util;

import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.StatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizerFactory;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizingAnnotation;

import java.lang.annotation.*;
import java.lang.reflect.Method;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Fails the statement if it didn't touch the expected number of rows. Used on updates that address a single
 * Target or Item by key, where touching nothing means the row has gone missing.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(value = MustUpdate.Handler.class)
public @interface MustUpdate {
    /**
     * Number of rows that should be updated. (-1 means any except 0)
     */
    int value() default -1;

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            int expectedCount = ((MustUpdate) annotation).value();
            String methodName = method.getDeclaringClass().getSimpleName() + "." + method.getName() + "()";
            return stmt -> stmt.addCustomizer(new StatementCustomizer() {
                @Override
                public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws SQLException {
                    long updateCount = stmt.getUpdateCount();
                    if (expectedCount == -1) {
                        if (updateCount == 0) {
                            throw new Exception(methodName + " didn't update any rows");
                        }
                    } else if (expectedCount != updateCount) {
                        throw new Exception(methodName + " expected to update " + expectedCount +
                                            " rows but updated " + updateCount);
                    }
                }
            });
        }
    }

    class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }
    }
}

package com.aletheia.engine.core.dao;

import com.aletheia.engine.types.TaskStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * {@link TaskStatus} is stored as its smallint id in {@code verification_task.status}.
 * Both directions are registered on the shared {@code Jdbi} by the producer.
 */
public final class TaskStatusColumn {

    private TaskStatusColumn() {
    }

    public static final class Mapper implements ColumnMapper<TaskStatus> {

        @Override
        public TaskStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
            short id = r.getShort(columnNumber);
            if (r.wasNull()) {
                return null;
            }
            try {
                return TaskStatus.fromId(id);
            } catch (IllegalArgumentException e) {
                throw new SQLException("Unknown task status id " + id + " in column " + columnNumber, e);
            }
        }
    }

    public static final class Binder extends AbstractArgumentFactory<TaskStatus> {

        public Binder() {
            super(Types.SMALLINT);
        }

        @Override
        protected Argument build(TaskStatus value, ConfigRegistry config) {
            short id = (short) value.id();
            return (position, statement, ctx) -> statement.setShort(position, id);
        }
    }
}

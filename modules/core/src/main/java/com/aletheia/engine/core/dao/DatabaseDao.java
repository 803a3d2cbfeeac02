package com.aletheia.engine.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

public interface DatabaseDao {

    @SqlQuery("SELECT version()")
    String pgVersion();

    @SqlQuery("SELECT 1")
    int ping();

    @SqlQuery("SELECT to_regclass(:table) IS NOT NULL")
    boolean tableExists(@Bind("table") String table);

    /** Sends a NOTIFY on {@code channel}; returns 1. */
    @SqlQuery("SELECT COUNT(*) FROM (SELECT pg_notify(:channel, :payload)) AS sent")
    int notify(@Bind("channel") String channel, @Bind("payload") String payload);
}

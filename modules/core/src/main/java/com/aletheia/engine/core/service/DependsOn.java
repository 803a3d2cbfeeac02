package com.aletheia.engine.core.service;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Services the annotated service needs RUNNING before it starts; it fails together with
 * any of them. Entries with no bean in the current build (the database service under the
 * in-memory store) are skipped.
 */
@Inherited
@Target(TYPE)
@Retention(RUNTIME)
public @interface DependsOn {

    Class<? extends ManagedService>[] value();
}

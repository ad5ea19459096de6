/**
 * JDBC adapter for the data store SPI.
 *
 * <p>Intended for single-writer stores such as SQLite, typically behind an
 * {@code ExclusiveWriter}.</p>
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.adapter.jdbc;

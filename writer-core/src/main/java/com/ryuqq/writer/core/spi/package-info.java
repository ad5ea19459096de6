/**
 * Data store Service Provider Interface (SPI) package.
 *
 * <p>This package defines the opaque handles the writer consumes. Adapter modules
 * (writer-adapter-jdbc, writer-adapter-inmemory) provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.writer.core.spi.Database} - Opens transactions</li>
 *   <li>{@link com.ryuqq.writer.core.spi.Transaction} - Commit / rollback of one unit of work</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on JDBC or any driver</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, JDBC for SQLite and friends</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.core.spi;

/**
 * Scoped transaction support: open, run, then commit or roll back on every exit path.
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.core.transaction;

/**
 * Execution-context tokens.
 *
 * <p>{@link com.ryuqq.writer.core.context.WorkerToken} replaces thread identity checks:
 * a worker's token is passed explicitly into the work it runs and compared against the
 * token the writer recorded when the worker claimed activation.</p>
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.core.context;

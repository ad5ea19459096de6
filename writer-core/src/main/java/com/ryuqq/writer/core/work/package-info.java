/**
 * Work functions submitted to a writer.
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.core.work;

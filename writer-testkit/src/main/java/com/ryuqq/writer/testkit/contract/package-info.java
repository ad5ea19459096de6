/**
 * Reusable contract tests for {@link com.ryuqq.writer.application.writer.Writer} implementations.
 */
package com.ryuqq.writer.testkit.contract;

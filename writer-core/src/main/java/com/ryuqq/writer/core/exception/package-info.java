/**
 * Writer exception hierarchy.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.writer.core.exception.WriterNotInitialisedException} - submit on an uninitialised writer</li>
 *   <li>{@link com.ryuqq.writer.core.exception.WriterInterruptedException} - caller interrupted before hand-off</li>
 *   <li>{@link com.ryuqq.writer.core.exception.TransactionException} - begin / commit / rollback failure</li>
 * </ul>
 *
 * <p>Exceptions thrown by submitted work are delivered to the submitting caller unchanged
 * and are not part of this hierarchy.</p>
 *
 * @since 1.0.0
 * @author Writer Team
 */
package com.ryuqq.writer.core.exception;

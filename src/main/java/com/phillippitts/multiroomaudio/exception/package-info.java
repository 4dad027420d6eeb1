/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.multiroomaudio.exception.MultiRoomAudioException}:
 * <ul>
 *   <li>{@link com.phillippitts.multiroomaudio.exception.PlayerConfigStoreException} - the
 *       players file could not be read or written</li>
 *   <li>{@link com.phillippitts.multiroomaudio.exception.DeviceCommandException} - an audio or
 *       signalling tool could not be launched</li>
 * </ul>
 *
 * <p>The orchestrator converts these into failed
 * {@link com.phillippitts.multiroomaudio.domain.OperationResult}s; anything that still reaches the
 * web layer is mapped by {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.multiroomaudio.exception;

/**
 * Immutable domain types shared by the orchestration core and its adapters.
 *
 * <p>{@link com.phillippitts.multiroomaudio.domain.PlayerConfig} is the persisted record of one
 * room player; {@link com.phillippitts.multiroomaudio.domain.OperationResult} is the
 * {@code (success, message)} pair every orchestrator mutation returns instead of throwing.
 */
package com.phillippitts.multiroomaudio.domain;

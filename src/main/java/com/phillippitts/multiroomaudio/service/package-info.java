/**
 * Player management services.
 *
 * <ul>
 *   <li>{@code process}: spawning, supervising and signalling player processes</li>
 *   <li>{@code provider}: per-backend command building and validation</li>
 *   <li>{@code store}: persisted player configurations</li>
 *   <li>{@code audio}: ALSA device discovery and mixer volume</li>
 *   <li>{@code player}: the orchestrator composing the above</li>
 *   <li>{@code status}: periodic status snapshots and their listeners</li>
 * </ul>
 */
package com.phillippitts.multiroomaudio.service;

/**
 * REST and Server-Sent Events surface over the player orchestrator.
 */
package com.phillippitts.multiroomaudio.presentation;

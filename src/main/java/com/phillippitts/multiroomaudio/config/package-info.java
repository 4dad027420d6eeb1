/**
 * Spring configuration: bean wiring for the player core, thread pools and bound properties.
 */
package com.phillippitts.multiroomaudio.config;

/**
 * Placement of bridged devices on commissioning servers per bridge mode.
 */
package com.hubbridge.core.topology;

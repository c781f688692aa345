/**
 * Dotted-quad IPv4 address syntax checking.
 *
 * <p>Only syntax is checked; no address classes, reserved ranges or name
 * resolution.</p>
 */
package com.questrail.gridcheck.ipv4;

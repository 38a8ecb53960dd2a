/**
 * Administration surface.
 * <ul>
 *   <li>{@link com.hubbridge.core.admin.AdminCommand} / {@link com.hubbridge.core.admin.AdminCommandDispatcher} – command verbs mapped to bridge operations</li>
 *   <li>{@link com.hubbridge.core.admin.AdminQueries} – settings, plugins, devices and clusters</li>
 *   <li>{@link com.hubbridge.core.admin.PackageInstaller} – package manager seam for install and update</li>
 * </ul>
 */
package com.hubbridge.core.admin;

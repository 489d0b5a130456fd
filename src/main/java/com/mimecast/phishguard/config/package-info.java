/**
 * Handles the configuration of the analyzer.
 *
 * <p>Provides the configuration foundation and typed accessors for:
 * <ul>
 *   <li><b>keywords</b>: versioned suspicious, trust and suspicious domain lists.</li>
 *   <li><b>endpoint</b>: HTTP bind address, port, worker threads and upload limit.</li>
 *   <li><b>templates</b>: localized highlight sentences and insight descriptions.</li>
 * </ul>
 *
 * <p>Files are JSON5 and read with Gson in lenient mode.
 */
package com.mimecast.phishguard.config;

/**
 * PhishGuard, a heuristic phishing email classifier.
 *
 * <p>Accepts a raw RFC 822 message or a plain text submission and returns a verdict, a confidence,
 * <br>human readable highlights and a fixed set of numeric insights.
 *
 * <p>This project can be compiled into a runnable JAR.
 * <br>A CLI interface is implemented for one-off analysis and for running the HTTP endpoint.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar phishguard.jar
 *      Phishing email classifier
 *
 *      usage:   [-c &lt;arg&gt;] [-f &lt;arg&gt;] [-s &lt;arg&gt;] [--server] [-t &lt;arg&gt;] [-v]
 *      -c,--conf &lt;arg&gt;      Path to configuration file (Default: bundled analyzer.json5)
 *      -f,--file &lt;arg&gt;      EML file to analyze
 *      -s,--subject &lt;arg&gt;   Subject for --text
 *         --server         Run the HTTP endpoint
 *      -t,--text &lt;arg&gt;      Message body text to analyze
 *      -v,--verbose        Enable logging
 * </pre>
 *
 * <h2>Example:</h2>
 * <pre>
 *      $ java -jar phishguard.jar --text "Verify your account now!" --subject "Account suspended"
 * </pre>
 */
package com.mimecast.phishguard;

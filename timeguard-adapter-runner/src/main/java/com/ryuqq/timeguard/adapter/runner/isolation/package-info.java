/**
 * Isolated execution units.
 *
 * <p>An execution unit is a child JVM that receives a copy of the work input on stdin and
 * answers with a single prefixed JSON line on stdout. {@link com.ryuqq.timeguard.adapter.runner.isolation.IsolatedWorkerMain}
 * is the child entry point.</p>
 */
package com.ryuqq.timeguard.adapter.runner.isolation;

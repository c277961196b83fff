/**
 * The environment state consumed by sensors: the {@link com.sensortwin.core.environment.EnvironmentQuery}
 * contract, its never-failing lookup helpers and a static in-memory implementation used by
 * scenarios and tests.
 */
package com.sensortwin.core.environment;

/**
 * Ground-truth anomaly labels, derived from the environment state and the
 * observed reading independently of the imperfection pipeline.
 */
package com.sensortwin.core.groundtruth;

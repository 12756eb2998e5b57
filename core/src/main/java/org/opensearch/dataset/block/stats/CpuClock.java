/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.stats;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;

/** CPU time readings. */
final class CpuClock {

  private CpuClock() {}

  /**
   * Returns the CPU time consumed by the whole process in nanoseconds. Falls back to the current
   * thread's CPU time on JVMs without the HotSpot management extension.
   */
  static long processCpuNanos() {
    OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    if (os instanceof com.sun.management.OperatingSystemMXBean process) {
      long cpu = process.getProcessCpuTime();
      if (cpu >= 0) {
        return cpu;
      }
    }
    ThreadMXBean threads = ManagementFactory.getThreadMXBean();
    return threads.isCurrentThreadCpuTimeSupported() ? threads.getCurrentThreadCpuTime() : 0L;
  }
}

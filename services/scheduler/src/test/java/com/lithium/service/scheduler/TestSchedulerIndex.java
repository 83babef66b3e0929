/*
 * Copyright (C) 2017-2019 Dremio Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lithium.service.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchedulerIndex} */
public class TestSchedulerIndex {

  private static SchedulerIndex indexOf(int workers) {
    SchedulerIndex index = new SchedulerIndex();
    for (int i = 0; i < workers; i++) {
      index.add(i);
    }
    return index;
  }

  @Test
  public void testEmptyIndexHasNoTarget() {
    assertThat(new SchedulerIndex().nextTarget()).isEmpty();
  }

  @Test
  public void testRoundRobin() {
    SchedulerIndex index = indexOf(3);
    List<Integer> targets = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      targets.add(index.nextTarget().getAsInt());
    }
    assertThat(targets).containsExactly(0, 1, 2, 0, 1, 2, 0);
    assertThat(index.size()).isEqualTo(3);
  }

  @Test
  public void testIdleWorkerIsPreferred() {
    SchedulerIndex index = indexOf(4);
    index.prioritize(3);
    assertThat(index.snapshot()).containsExactly(3, 0, 1, 2);
    assertThat(index.nextTarget()).hasValue(3);
    assertThat(index.nextTarget()).hasValue(0);
  }

  @Test
  public void testEachIdStaysOnce() {
    SchedulerIndex index = indexOf(3);
    index.prioritize(1);
    index.prioritize(1);
    index.nextTarget();
    index.prioritize(2);
    assertThat(index.snapshot()).containsExactlyInAnyOrder(0, 1, 2);
  }

  @Test
  public void testRemove() {
    SchedulerIndex index = indexOf(3);
    assertThat(index.remove(2)).isTrue();
    assertThat(index.remove(2)).isFalse();
    assertThat(index.snapshot()).containsExactly(0, 1);
  }
}

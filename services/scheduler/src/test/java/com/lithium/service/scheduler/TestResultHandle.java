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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

public class TestResultHandle {

  @Test
  public void testPendingHandle() throws Exception {
    ResultHandle<String> handle = new ResultHandle<>("pending");
    assertThat(handle.isDone()).isFalse();
    assertThat(handle.tryGet()).isEmpty();
    assertThatThrownBy(() -> handle.get(10, TimeUnit.MILLISECONDS))
        .isInstanceOf(TimeoutException.class)
        .hasMessageContaining("pending");
  }

  @Test
  public void testValue() throws Exception {
    ResultHandle<Integer> handle = new ResultHandle<>("value");
    assertThat(handle.set(42)).isTrue();
    assertThat(handle.get()).isEqualTo(42);
    assertThat(handle.get(1, TimeUnit.SECONDS)).isEqualTo(42);
    assertThat(handle.tryGet()).contains(42);
    assertThat(handle.isDone()).isTrue();
    assertThat(handle.isFailed()).isFalse();
    assertThat(handle.isCancelled()).isFalse();
  }

  @Test
  public void testFirstWriteWins() throws Exception {
    ResultHandle<Integer> handle = new ResultHandle<>("once");
    assertThat(handle.set(1)).isTrue();
    assertThat(handle.set(2)).isFalse();
    assertThat(handle.setFailure(new IOException("late"))).isFalse();
    assertThat(handle.setCancelled()).isFalse();
    assertThat(handle.get()).isEqualTo(1);
  }

  @Test
  public void testFailureCarriesOriginalCause() {
    IOException cause = new IOException("disk gone");
    ResultHandle<String> handle = new ResultHandle<>("failing");
    handle.setFailure(cause);

    assertThat(handle.isFailed()).isTrue();
    assertThatThrownBy(handle::get)
        .isInstanceOf(TaskExecutionException.class)
        .isInstanceOf(ExecutionException.class)
        .hasCause(cause);
    assertThatThrownBy(handle::tryGet).isInstanceOf(TaskExecutionException.class).hasCause(cause);
  }

  @Test
  public void testCancelled() {
    ResultHandle<String> handle = new ResultHandle<>("dropped");
    handle.setCancelled();

    assertThat(handle.isCancelled()).isTrue();
    assertThat(handle.isDone()).isTrue();
    assertThatThrownBy(handle::get).isInstanceOf(TaskCancelledException.class);
    assertThatThrownBy(handle::tryGet).isInstanceOf(TaskCancelledException.class);
  }

  @Test
  public void testCallersCannotCancel() {
    ResultHandle<String> handle = new ResultHandle<>("stubborn");
    assertThat(handle.cancel(true)).isFalse();
    assertThat(handle.isDone()).isFalse();
  }

  @Test
  public void testCompletableFutureView() throws Exception {
    ResultHandle<Integer> handle = new ResultHandle<>("composed");
    CompletableFuture<Integer> doubled = handle.toCompletableFuture().thenApply(v -> v * 2);
    handle.set(21);
    assertThat(doubled.get(1, TimeUnit.SECONDS)).isEqualTo(42);

    // completing the view leaves the handle alone
    ResultHandle<Integer> other = new ResultHandle<>("independent");
    other.toCompletableFuture().complete(7);
    assertThat(other.isDone()).isFalse();
  }

  @Test
  public void testNullValue() throws Exception {
    ResultHandle<Void> handle = new ResultHandle<>("void");
    handle.set(null);
    assertThat(handle.isDone()).isTrue();
    assertThat(handle.get()).isNull();
    assertThat(handle.tryGet()).isEmpty();
  }
}

package com.leaplabs.discovery.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class JobStatusTest {

  @Test
  void mapsServiceVocabulary() {
    assertEquals(Optional.of(JobStatus.QUEUED), JobStatus.fromRemote("pending"));
    assertEquals(Optional.of(JobStatus.RUNNING), JobStatus.fromRemote("Processing"));
    assertEquals(Optional.of(JobStatus.COMPLETED), JobStatus.fromRemote("completed"));
    assertEquals(Optional.of(JobStatus.FAILED), JobStatus.fromRemote("error"));
    assertTrue(JobStatus.fromRemote("weird").isEmpty());
    assertTrue(JobStatus.fromRemote(null).isEmpty());
  }

  @Test
  void onlyForwardTransitionsAreAllowed() {
    assertTrue(JobStatus.SUBMITTING.canAdvanceTo(JobStatus.QUEUED));
    assertTrue(JobStatus.QUEUED.canAdvanceTo(JobStatus.COMPLETED));
    assertFalse(JobStatus.RUNNING.canAdvanceTo(JobStatus.QUEUED));
    for (JobStatus terminal : new JobStatus[] {JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.EXPIRED}) {
      for (JobStatus next : JobStatus.values()) {
        assertFalse(terminal.canAdvanceTo(next), terminal + " -> " + next);
      }
    }
  }
}

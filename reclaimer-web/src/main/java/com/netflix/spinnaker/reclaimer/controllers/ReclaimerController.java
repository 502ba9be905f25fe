/*
 * Copyright 2017 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.spinnaker.reclaimer.controllers;

import com.netflix.spinnaker.reclaimer.engine.RunReport;
import com.netflix.spinnaker.reclaimer.engine.RunState;
import com.netflix.spinnaker.reclaimer.trigger.ReclamationInvoker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/reclaim")
public class ReclaimerController {

  private final ReclamationInvoker reclamationInvoker;

  @Autowired
  public ReclaimerController(ReclamationInvoker reclamationInvoker) {
    this.reclamationInvoker = reclamationInvoker;
  }

  /**
   * Runs a reclamation cycle on demand and returns its report.
   * The body is optional; {@code {"retention_days": 14}} overrides the configured window.
   */

  @RequestMapping(
    method = RequestMethod.POST,
    produces = MediaType.APPLICATION_JSON_VALUE
  )
  public ResponseEntity<RunReport> reclaim(@RequestBody(required = false) Map<String, Object> input) {
    RunReport report = reclamationInvoker.invoke(input);
    return ResponseEntity.status(statusOf(report)).body(report);
  }

  static HttpStatus statusOf(RunReport report) {
    if (report.getState() != RunState.ABORTED) {
      return HttpStatus.OK;
    }

    if (report.getError() != null && RunReport.ERROR_CONFIGURATION.equals(report.getError().getType())) {
      return HttpStatus.BAD_REQUEST;
    }

    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}

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
import com.netflix.spinnaker.reclaimer.trigger.RunInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class ReclaimerExceptionHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReclaimerExceptionHandler.class);

  @ExceptionHandler(RunInProgressException.class)
  public ResponseEntity<Map<String, String>> runInProgress(RunInProgressException e) {
    LOGGER.warn("Rejected reclamation request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error("run-in-progress", e.getMessage()));
  }

  /**
   * A body that is not a JSON object is a configuration error, same as a bad retention_days
   */

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
    LOGGER.warn("Rejected reclamation request with unreadable body", e);
    return ResponseEntity.badRequest()
      .body(error(RunReport.ERROR_CONFIGURATION, "Request body must be a JSON object"));
  }

  private static Map<String, String> error(String type, String message) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("type", type);
    body.put("message", message);
    return body;
  }
}

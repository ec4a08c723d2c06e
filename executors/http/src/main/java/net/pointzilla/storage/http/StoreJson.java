// This file is part of PointZilla.
// Copyright (C) 2026  The PointZilla Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pointzilla.storage.http;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;

import net.pointzilla.data.Point;
import net.pointzilla.data.PointType;
import net.pointzilla.data.TimeRange;
import net.pointzilla.storage.AppendStatus;
import net.pointzilla.storage.AppendStatus.AppendState;

/**
 * The JSON bodies exchanged with the store. Field names follow the store's
 * capitalized convention.
 *
 * @since 1.0
 */
final class StoreJson {
  static final String TYPE_POINT = "Point";
  static final String TYPE_GAP = "Gap";

  private StoreJson() { }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  static class PointJson {
    @JsonProperty("Time")
    public String time;

    @JsonProperty("Type")
    public String type;

    @JsonProperty("Value")
    public Double value;

    @JsonProperty("GradeCode")
    public Integer grade_code;

    @JsonProperty("Qualifiers")
    public List<String> qualifiers;

    static PointJson of(final Point point) {
      final PointJson json = new PointJson();
      json.time = point.time().toString();
      if (point.isGap()) {
        json.type = TYPE_GAP;
        return json;
      }
      json.type = TYPE_POINT;
      json.value = point.value();
      json.grade_code = point.gradeCode();
      if (!point.qualifiers().isEmpty()) {
        json.qualifiers = point.qualifiers().asList();
      }
      return json;
    }

    /**
     * @return The point.
     * @throws IllegalArgumentException if the time is missing or invalid.
     */
    Point toPoint() {
      final Instant instant;
      try {
        instant = Instant.parse(time);
      } catch (NullPointerException | DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid point time: " + time, e);
      }
      if (TYPE_GAP.equalsIgnoreCase(type) || value == null) {
        return Point.gap(instant);
      }
      return Point.newBuilder()
          .setTime(instant)
          .setType(PointType.VALUE)
          .setValue(value)
          .setGradeCode(grade_code)
          .setQualifiers(qualifiers)
          .build();
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  static class TimeRangeJson {
    @JsonProperty("Start")
    public String start;

    @JsonProperty("End")
    public String end;

    static TimeRangeJson of(final TimeRange range) {
      if (range == null) {
        return null;
      }
      final TimeRangeJson json = new TimeRangeJson();
      json.start = range.start().toString();
      json.end = range.end().toString();
      return json;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  static class AppendRequest {
    @JsonProperty("Points")
    public List<PointJson> points;

    @JsonProperty("TimeRange")
    public TimeRangeJson time_range;

    static AppendRequest of(final List<Point> points, final TimeRange range) {
      final AppendRequest request = new AppendRequest();
      request.points = Lists.newArrayListWithCapacity(points.size());
      for (final Point point : points) {
        request.points.add(PointJson.of(point));
      }
      request.time_range = TimeRangeJson.of(range);
      return request;
    }
  }

  static class ResolveResponse {
    @JsonProperty("UniqueId")
    public String unique_id;
  }

  static class AppendResponse {
    @JsonProperty("AppendRequestIdentifier")
    public String append_request_identifier;
  }

  static class StatusResponse {
    @JsonProperty("AppendStatus")
    public String append_status;

    @JsonProperty("NumberOfPointsAppended")
    public int number_of_points_appended;

    @JsonProperty("Message")
    public String message;

    /**
     * @return The status.
     * @throws IllegalArgumentException if the state is unknown.
     */
    AppendStatus toStatus() {
      if (append_status == null) {
        throw new IllegalArgumentException("Missing AppendStatus");
      }
      for (final AppendState state : AppendState.values()) {
        if (state.name().equalsIgnoreCase(append_status)) {
          return AppendStatus.of(state, number_of_points_appended, message);
        }
      }
      throw new IllegalArgumentException("Unknown AppendStatus: "
          + append_status);
    }
  }

  static class PointsResponse {
    @JsonProperty("Points")
    public List<PointJson> points;

    List<Point> toPoints() {
      final List<Point> result = Lists.newArrayList();
      if (points != null) {
        for (final PointJson point : points) {
          result.add(point.toPoint());
        }
      }
      return result;
    }
  }
}

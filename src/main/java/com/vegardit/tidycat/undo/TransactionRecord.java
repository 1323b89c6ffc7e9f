/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.undo;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.jdt.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Persistent description of one applied tidy run, stored as <code>&lt;id&gt;.json</code> in the undo directory.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "created_at", "source_dir", "destination_dir", "moves", "removed_empty_dirs", "undone_at"})
public class TransactionRecord {

   @JsonProperty("id")
   public String id = lateNonNull();

   /** ISO-8601 timestamp in UTC */
   @JsonProperty("created_at")
   public String createdAt = lateNonNull();

   @JsonProperty("source_dir")
   public @Nullable String sourceDir;

   @JsonProperty("destination_dir")
   public @Nullable String destinationDir;

   /** entries that could not be read are null */
   @JsonProperty("moves")
   public @Nullable List<@Nullable MoveRecord> moves = new ArrayList<>();

   /** true if the stored <code>moves</code> value is not a list */
   @JsonIgnore
   public boolean movesMalformed;

   @JsonProperty("removed_empty_dirs")
   public @Nullable List<String> removedEmptyDirs = new ArrayList<>();

   @JsonProperty("undone_at")
   @JsonInclude(JsonInclude.Include.ALWAYS)
   public @Nullable String undoneAt;

   /** the file this record was loaded from or written to */
   @JsonIgnore
   public @Nullable Path file;

   /**
    * @return the creation time or null if the stored value cannot be parsed
    */
   @JsonIgnore
   public @Nullable Instant getCreatedAtInstant() {
      return parseTimestamp(createdAt);
   }

   @JsonIgnore
   public int getMoveCount() {
      final var moves = this.moves;
      return moves == null ? 0 : moves.size();
   }

   @JsonIgnore
   public boolean isUndone() {
      final var undoneAt = this.undoneAt;
      return undoneAt != null && !undoneAt.isBlank();
   }

   @JsonSetter("moves")
   void setMoves(final @Nullable JsonNode node) {
      if (node == null || !node.isArray()) {
         moves = null;
         movesMalformed = true;
         return;
      }
      final var entries = new ArrayList<@Nullable MoveRecord>(node.size());
      for (final var entry : node) {
         entries.add(entry.isObject() //
               ? new MoveRecord(textOf(entry.get("from")), textOf(entry.get("to")), textOf(entry.get("rule_id")))
               : null);
      }
      moves = entries;
      movesMalformed = false;
   }

   private static @Nullable String textOf(final @Nullable JsonNode node) {
      return node == null || !node.isValueNode() || node.isNull() ? null : node.asText();
   }

   static @Nullable Instant parseTimestamp(final @Nullable String value) {
      if (value == null || value.isBlank())
         return null;
      try {
         return OffsetDateTime.parse(value).toInstant();
      } catch (final DateTimeParseException ex) {
         try {
            // timestamps without offset are UTC
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
         } catch (final DateTimeParseException ex2) {
            return null;
         }
      }
   }
}

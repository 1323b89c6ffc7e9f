/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Maps kind names as used by <code>kind</code> conditions to extension groups.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class KindTable {

   static final List<String> IMAGE_EXTENSIONS = List.of( //
      ".png", ".jpg", ".jpeg", ".gif", ".webp", ".svg", ".avif", ".bmp", ".heic", ".tif", ".tiff", ".ico", ".jfif");
   static final List<String> DOCUMENT_EXTENSIONS = List.of( //
      ".pdf", ".doc", ".docx", ".odt", ".pages", ".txt", ".rtf", ".md", ".markdown", ".epub");
   static final List<String> AUDIO_EXTENSIONS = List.of( //
      ".mp3", ".wav", ".m4a", ".aac", ".flac", ".ogg", ".opus", ".aif", ".aiff");
   static final List<String> VIDEO_EXTENSIONS = List.of( //
      ".mp4", ".mov", ".mkv", ".avi", ".wmv", ".webm", ".m4v", ".ts", ".mts");
   static final List<String> ARCHIVE_EXTENSIONS = List.of( //
      ".zip", ".rar", ".7z", ".tar", ".gz", ".tar.gz", ".tgz", ".bz2", ".xz", ".zst", ".cab");
   static final List<String> CODE_EXTENSIONS = List.of( //
      ".py", ".js", ".ts", ".tsx", ".jsx", ".java", ".c", ".cpp", ".h", ".hpp", ".go", ".rs", ".rb", ".php", ".swift", ".kt", //
      ".json", ".sql", ".ini", ".cfg", ".conf", ".toml", ".yaml", ".yml", ".xml", ".html", ".css", ".scss", ".sh", ".zsh");

   public static final KindTable DEFAULT;

   static {
      final var kinds = new LinkedHashMap<String, Set<String>>();
      kinds.put("image", Set.copyOf(IMAGE_EXTENSIONS));
      kinds.put("image_png", Set.of(".png"));
      kinds.put("document", Set.copyOf(DOCUMENT_EXTENSIONS));
      kinds.put("audio", Set.copyOf(AUDIO_EXTENSIONS));
      kinds.put("video", Set.copyOf(VIDEO_EXTENSIONS));
      kinds.put("archive", Set.copyOf(ARCHIVE_EXTENSIONS));
      kinds.put("code", Set.copyOf(CODE_EXTENSIONS));
      DEFAULT = new KindTable(kinds);
   }

   private final Map<String, Set<String>> extensionsByKind;

   public KindTable(final Map<String, Set<String>> extensionsByKind) {
      this.extensionsByKind = Map.copyOf(extensionsByKind);
   }

   /**
    * @param kind a normalized kind name
    * @return the extensions of the given kind or null if the kind is unknown
    */
   public @Nullable Set<String> getExtensions(final String kind) {
      return extensionsByKind.get(kind);
   }

   public Set<String> getKinds() {
      return extensionsByKind.keySet();
   }
}

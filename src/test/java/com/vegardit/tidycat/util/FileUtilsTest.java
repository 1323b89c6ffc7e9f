/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.util;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class FileUtilsTest {

   @TempDir
   Path tempDir = lateNonNull();

   @Test
   void testIsEmptyDir() throws IOException {
      final var dir = Files.createDirectory(tempDir.resolve("dir"));
      assertThat(FileUtils.isEmptyDir(dir)).isTrue();
      Files.writeString(dir.resolve("a.txt"), "a");
      assertThat(FileUtils.isEmptyDir(dir)).isFalse();
   }

   @Test
   void testIsSameOrUnder() {
      final var root = tempDir.resolve("root");
      assertThat(FileUtils.isSameOrUnder(root, root)).isTrue();
      assertThat(FileUtils.isSameOrUnder(root.resolve("a/b"), root)).isTrue();
      assertThat(FileUtils.isSameOrUnder(tempDir.resolve("rootless"), root)).isFalse();
   }

   @Test
   void testMoveNeverReplacesTarget() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.txt"), "source");
      final var target = Files.writeString(tempDir.resolve("b.txt"), "target");

      assertThatThrownBy(() -> FileUtils.move(source, target)).isInstanceOf(FileAlreadyExistsException.class);
      assertThat(source).hasContent("source");
      assertThat(target).hasContent("target");
   }

   @Test
   void testMove() throws IOException {
      final var source = Files.writeString(tempDir.resolve("a.txt"), "source");
      final var target = tempDir.resolve("b.txt");

      FileUtils.move(source, target);
      assertThat(source).doesNotExist();
      assertThat(target).hasContent("source");
   }

   @Test
   void testResolveRelative() {
      assertThat(FileUtils.resolveRelative(tempDir, "Images/PNG")).isEqualTo(tempDir.resolve("Images").resolve("PNG"));
      assertThat(FileUtils.resolveRelative(tempDir, "/Docs//Text/ ")).isEqualTo(tempDir.resolve("Docs").resolve("Text"));
   }

   @Test
   void testToAbsoluteExpandsHome() {
      final var home = Path.of(System.getProperty("user.home")).toAbsolutePath().normalize();
      assertThat(FileUtils.toAbsolute(Path.of("~"))).isEqualTo(FileUtils.toAbsolute(home));
      assertThat(FileUtils.toAbsolute(Path.of("~/Downloads"))).isEqualTo(FileUtils.toAbsolute(home.resolve("Downloads")));
      assertThat(FileUtils.toAbsolute(Path.of("a/../b"))).isAbsolute().endsWithRaw(Path.of("b"));
   }
}

/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.util;

import java.io.IOException;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class YamlUtils {

   /**
    * Controls how a config field is rendered by {@link YamlUtils#toYamlString(Object)}.
    */
   @Retention(RetentionPolicy.RUNTIME)
   @Target(ElementType.FIELD)
   public @interface ToYamlString {
      boolean ignore() default false;

      String name() default "";
   }

   static String camelCaseToHyphen(final String str) {
      final var sb = new StringBuilder(str.length() + 4);
      for (var i = 0; i < str.length(); i++) {
         final char ch = str.charAt(i);
         if (Character.isUpperCase(ch)) {
            if (i > 0 && !Character.isUpperCase(str.charAt(i - 1))) {
               sb.append('-');
            }
            sb.append(Character.toLowerCase(ch));
         } else {
            sb.append(ch);
         }
      }
      return sb.toString();
   }

   /**
    * Parses the given YAML file. An empty file results in an empty map.
    *
    * @throws IllegalArgumentException if the file is not valid YAML or its root element is not a mapping
    */
   public static Map<String, Object> parseYaml(final Path yamlFile) throws IOException {
      final var loaderOpts = new LoaderOptions();
      final var yaml = new Yaml(new SafeConstructor(loaderOpts), new Representer(new DumperOptions()), new DumperOptions(), loaderOpts,
         new Resolver() {
            @Override
            protected void addImplicitResolvers() {
               // keep date-like values such as "2025-09-04" as plain strings
               addImplicitResolver(Tag.STR, TIMESTAMP, "0123456789", 50);
               super.addImplicitResolvers();
            }
         });

      final Object root;
      try (var in = Files.newBufferedReader(yamlFile)) {
         root = yaml.load(in);
      } catch (final YAMLException ex) {
         throw new IllegalArgumentException("Config file [" + yamlFile + "] is not valid YAML: " + ex.getMessage(), ex);
      }
      if (root == null)
         return new LinkedHashMap<>();
      if (!(root instanceof final Map<?, ?> rootMap))
         throw new IllegalArgumentException("Config file [" + yamlFile + "] must contain a YAML mapping at root level.");

      final var result = new LinkedHashMap<String, Object>();
      rootMap.forEach((k, v) -> result.put(String.valueOf(k), v));
      return result;
   }

   public static String toYamlString(final Object obj) {
      final var options = new DumperOptions();
      options.setIndent(2);
      options.setPrettyFlow(true);
      options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
      final var representer = new Representer(options) {
         {
            multiRepresenters.put(Path.class, path -> representScalar(Tag.STR, path.toString()));
         }

         @Override
         protected MappingNode representJavaBean(final Set<Property> properties, final Object javaBean) {
            if (!classTags.containsKey(javaBean.getClass())) {
               // render beans as plain mappings without a class tag
               addClassTag(javaBean.getClass(), Tag.MAP);
            }
            return super.representJavaBean(properties, javaBean);
         }

         @Override
         protected @Nullable NodeTuple representJavaBeanProperty(final Object javaBean, final Property property,
               final @Nullable Object propertyValue, final Tag customTag) {
            final var anno = property.getAnnotation(ToYamlString.class);
            if (anno != null && anno.ignore())
               return null;

            final var node = super.representJavaBeanProperty(javaBean, property, propertyValue == null ? "<not configured>" : propertyValue,
               customTag);
            if (node == null)
               return null;

            final var name = anno == null || anno.name().isEmpty() ? property.getName() : anno.name();
            return new NodeTuple(representData(camelCaseToHyphen(name)), node.getValueNode());
         }
      };

      return new Yaml(representer, options).dump(obj);
   }

   private YamlUtils() {
   }
}

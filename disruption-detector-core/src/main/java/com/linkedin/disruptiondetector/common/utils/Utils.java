/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.disruptiondetector.common.utils;

import com.linkedin.disruptiondetector.exception.DisruptionDetectorException;
import java.util.function.Supplier;


public final class Utils {

  private Utils() {

  }

  /**
   * Instantiate a class through its public no-argument constructor.
   *
   * @param c The class to instantiate.
   * @param <T> The type of the instance.
   * @return A new instance of the class.
   */
  public static <T> T newInstance(Class<T> c) throws DisruptionDetectorException {
    validateNotNull(c, "Class to instantiate cannot be null.");
    try {
      return c.getConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new DisruptionDetectorException(c.getName() + " has no public no-argument constructor.", e);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new DisruptionDetectorException("Failed to instantiate " + c.getName(), e);
    }
  }

  /**
   * @return The context class loader of the current thread, or the class loader of the detector if there is none.
   */
  public static ClassLoader contextOrDetectorClassLoader() {
    ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
    return contextClassLoader != null ? contextClassLoader : Utils.class.getClassLoader();
  }

  /**
   * @param obj The reference to check.
   * @param errorMsg Message of the exception thrown if the reference is {@code null}.
   * @param <T> The type of the reference.
   * @return The reference.
   * @throws IllegalArgumentException if the reference is {@code null}.
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * Same as {@link #validateNotNull(Object, String)}, building the message only on failure.
   *
   * @param obj The reference to check.
   * @param errorMsgSupplier Supplier of the message of the exception thrown if the reference is {@code null}.
   * @param <T> The type of the reference.
   * @return The reference.
   */
  public static <T> T validateNotNull(T obj, Supplier<String> errorMsgSupplier) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsgSupplier.get());
    }
    return obj;
  }
}

package com.scholary.converthub.converter;

/**
 * Callback a converter uses to report progress and to check for cooperative cancellation.
 *
 * <p>Steps are on a 0-100 scale. Batch units pass {@link #NONE}; tracked single-file
 * conversions pass one bound to a progress-tracker task.
 */
public interface ConversionProgress {

  ConversionProgress NONE =
      new ConversionProgress() {
        @Override
        public void report(int step, String message) {}

        @Override
        public boolean isCancelled() {
          return false;
        }
      };

  void report(int step, String message);

  boolean isCancelled();
}

package io.menucast.cli;

@FunctionalInterface
public interface ServeRunner {
    int run(int portOverride, boolean schedulerEnabled) throws Exception;
}

package io.playengine.process;

@FunctionalInterface
public interface CancelCheck {
    CancelCheck NEVER = () -> false;

    boolean isCanceled();
}

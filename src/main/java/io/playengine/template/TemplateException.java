package io.playengine.template;

public class TemplateException extends Exception {
    public TemplateException(String message) {
        super(message);
    }
}

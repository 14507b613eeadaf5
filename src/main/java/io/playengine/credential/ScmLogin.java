package io.playengine.credential;

public record ScmLogin(String username, String password, boolean hasKey) {
    public static ScmLogin none() {
        return new ScmLogin(null, null, false);
    }

    public boolean hasUsername() {
        return username != null && !username.isEmpty();
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }
}

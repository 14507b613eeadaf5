package io.playengine.credential;

public record MachineLogin(String username, String becomeMethod, String becomeUsername) {
    public static MachineLogin none() {
        return new MachineLogin(null, null, null);
    }
}

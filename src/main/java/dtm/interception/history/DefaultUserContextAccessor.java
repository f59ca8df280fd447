package dtm.interception.history;

import lombok.NonNull;

public class DefaultUserContextAccessor implements UserContextAccessor {

    public static final String DEFAULT_USERNAME = "System";

    private final String username;

    public DefaultUserContextAccessor() {
        this(DEFAULT_USERNAME);
    }

    public DefaultUserContextAccessor(@NonNull String username) {
        this.username = username;
    }

    @Override
    public String getCurrentUsername() {
        return username;
    }

}

package io.menucast.core.model;

/**
 * A messaging channel. The access token is the bearer credential for every publish call
 * made on behalf of the account's projects.
 */
public record Account(long id, String name, String channelAccessToken) {
    public Account {
        name = name == null ? "" : name;
        channelAccessToken = channelAccessToken == null ? "" : channelAccessToken;
    }

    @Override
    public String toString() {
        return "Account[id=" + id + ", name=" + name + "]";
    }
}

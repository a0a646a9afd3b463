package com.scholary.mp3.converter.user;

/**
 * A registered user. The password is an opaque credential; this service does not authenticate.
 */
public record User(long id, String username, String password) {

  @Override
  public String toString() {
    return "User[id=" + id + ", username=" + username + "]";
  }
}

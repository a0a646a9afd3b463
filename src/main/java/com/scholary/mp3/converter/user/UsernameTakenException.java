package com.scholary.mp3.converter.user;

/** Thrown when registering a username that already exists. */
public class UsernameTakenException extends RuntimeException {

  public UsernameTakenException(String username) {
    super("Username already taken: " + username);
  }
}

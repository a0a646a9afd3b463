package com.scholary.mp3.converter.user;

import java.util.Optional;

/** Storage contract for users. Ids come from a sequence independent of job ids. */
public interface UserStore {

  /**
   * @throws UsernameTakenException if a user with the same name already exists
   */
  User create(String username, String password);

  Optional<User> get(long id);

  Optional<User> getByUsername(String username);
}

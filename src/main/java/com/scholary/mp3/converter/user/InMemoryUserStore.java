package com.scholary.mp3.converter.user;

import com.scholary.mp3.converter.job.IdSequence;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-lifetime user store keyed by id with a unique index on username. */
public class InMemoryUserStore implements UserStore {

  private final Map<Long, User> usersById = new ConcurrentHashMap<>();
  private final Map<String, User> usersByName = new ConcurrentHashMap<>();
  private final IdSequence ids = new IdSequence();

  @Override
  public User create(String username, String password) {
    // Claim the name atomically before publishing by id.
    User[] created = new User[1];
    usersByName.computeIfAbsent(
        username,
        name -> {
          created[0] = new User(ids.nextId(), name, password);
          return created[0];
        });
    if (created[0] == null) {
      throw new UsernameTakenException(username);
    }
    usersById.put(created[0].id(), created[0]);
    return created[0];
  }

  @Override
  public Optional<User> get(long id) {
    return Optional.ofNullable(usersById.get(id));
  }

  @Override
  public Optional<User> getByUsername(String username) {
    return Optional.ofNullable(usersByName.get(username));
  }
}

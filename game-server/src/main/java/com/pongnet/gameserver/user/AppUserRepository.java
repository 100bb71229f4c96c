package com.pongnet.gameserver.user;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {
    Optional<AppUser> findByUsername(String username);
    boolean existsByUsername(String username);

    /** Wins descending; the surrogate id keeps ties in registration order. */
    List<AppUser> findAllByOrderByWinCountDescIdAsc(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AppUser u set u.winCount = u.winCount + 1 where u.username = :username")
    int incrementWinCount(@Param("username") String username);
}

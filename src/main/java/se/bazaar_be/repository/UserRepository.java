package se.bazaar_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.bazaar_be.pojo.User;

public interface UserRepository extends JpaRepository<User, Long> {

    @Modifying(flushAutomatically = true)
    @Query("UPDATE User u SET u.trustScore = u.trustScore + :bonus, u.isVerified = true WHERE u.userId = :userId")
    int addVerificationBonus(@Param("userId") Long userId, @Param("bonus") int bonus);
}

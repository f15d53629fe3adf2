package com.infomedia.merchanthub.db.repository;

import com.infomedia.merchanthub.db.entity.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface RoleRepository extends JpaRepository<Role, Long> {

    Optional<Role> findByName(String name);

    @Query("select distinct r from Role r left join fetch r.permissions where r.isPrivate = false order by r.name")
    List<Role> findAllPublicWithPermissions();
}

package dev.llumos.repository;

import dev.llumos.domain.entity.Organization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

    @Query("""
            select o from Organization o
            where exists (select 1 from Prompt p where p.orgId = o.id and p.active = true)
            order by o.createdAt asc
            """)
    List<Organization> findWithActivePrompts();
}

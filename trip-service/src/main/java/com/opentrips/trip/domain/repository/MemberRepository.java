package com.opentrips.trip.domain.repository;

import com.opentrips.trip.domain.model.Member;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MemberRepository extends JpaRepository<Member, Long> {

    Optional<Member> findByIdAndOrganizationId(Long id, Long organizationId);
}

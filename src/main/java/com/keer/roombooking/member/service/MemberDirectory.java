package com.keer.roombooking.member.service;

import com.keer.roombooking.booking.service.BookingError;
import com.keer.roombooking.booking.service.BookingException;
import com.keer.roombooking.member.model.Member;
import com.keer.roombooking.member.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only view of the identity collaborator. Members are provisioned elsewhere.
 */
@Service
@RequiredArgsConstructor
public class MemberDirectory {

    private final MemberRepository memberRepository;

    public Optional<Member> find(Long memberId) {
        if (memberId == null) {
            return Optional.empty();
        }
        return memberRepository.findById(memberId);
    }

    public Member require(Long memberId) {
        return find(memberId)
                .orElseThrow(() -> new BookingException(BookingError.NOT_FOUND, "Member " + memberId + " not found"));
    }
}

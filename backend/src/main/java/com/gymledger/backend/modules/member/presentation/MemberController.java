package com.gymledger.backend.modules.member.presentation;

import java.util.UUID;

import com.gymledger.backend.global.security.SecurityUtils;
import com.gymledger.backend.global.security.StaffPrincipal;
import com.gymledger.backend.modules.member.application.MemberService;
import com.gymledger.backend.modules.member.application.MemberService.MemberAttributes;
import com.gymledger.backend.modules.member.domain.Member;
import com.gymledger.backend.modules.member.presentation.dto.CreateMemberRequest;
import com.gymledger.backend.modules.member.presentation.dto.MemberListResponse;
import com.gymledger.backend.modules.member.presentation.dto.MemberResponse;
import com.gymledger.backend.modules.member.presentation.dto.RestoreOfferResponse;
import com.gymledger.backend.modules.member.presentation.dto.UpdateMemberRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/members")
@Tag(name = "Members")
public class MemberController {

    private static final int MAX_PAGE_SIZE = 100;

    private final MemberService memberService;

    public MemberController(MemberService memberService) {
        this.memberService = memberService;
    }

    @PostMapping
    @Operation(summary = "Register a member")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Member created"),
            @ApiResponse(responseCode = "409", description = "Phone or email taken; restoreCandidateId names a deleted member to restore")
    })
    public ResponseEntity<MemberResponse> create(@Valid @RequestBody CreateMemberRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        MemberAttributes attributes = new MemberAttributes(
                request.fullName(),
                request.phone(),
                request.email(),
                request.gender(),
                request.dateOfBirth(),
                request.status()
        );
        Member member = memberService.createMember(principal.gymId(), principal.staffId(), attributes);
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(member));
    }

    @GetMapping
    @Operation(summary = "List members; deleted members only on request")
    public ResponseEntity<MemberListResponse> list(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestParam(name = "includeDeleted", defaultValue = "false") boolean includeDeleted
    ) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        PageRequest pageable = PageRequest.of(Math.max(page, 0), safeSize, Sort.by(Sort.Direction.ASC, "memberNumber"));
        Page<Member> result = memberService.listMembers(principal.gymId(), includeDeleted, pageable);
        return ResponseEntity.ok(new MemberListResponse(
                result.getContent().stream().map(MemberResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements()
        ));
    }

    @GetMapping("/restore-candidates")
    @Operation(summary = "Check a phone number before registering")
    public ResponseEntity<RestoreOfferResponse> restoreCandidates(@RequestParam("phone") String phone) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(RestoreOfferResponse.from(memberService.findOrOfferRestore(principal.gymId(), phone)));
    }

    @GetMapping("/{memberId}")
    public ResponseEntity<MemberResponse> get(@PathVariable UUID memberId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(MemberResponse.from(memberService.getMember(principal.gymId(), memberId)));
    }

    @PatchMapping("/{memberId}")
    public ResponseEntity<MemberResponse> update(@PathVariable UUID memberId, @Valid @RequestBody UpdateMemberRequest request) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        MemberAttributes attributes = new MemberAttributes(
                request.fullName(),
                request.phone(),
                request.email(),
                request.gender(),
                request.dateOfBirth(),
                request.status()
        );
        return ResponseEntity.ok(MemberResponse.from(
                memberService.updateMember(principal.gymId(), principal.staffId(), memberId, attributes)));
    }

    @DeleteMapping("/{memberId}")
    @Operation(summary = "Soft-delete a member")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Member tombstoned"),
            @ApiResponse(responseCode = "409", description = "Blocked by running memberships or pending payments")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID memberId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        memberService.softDelete(principal.gymId(), principal.staffId(), memberId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{memberId}/restore")
    @Operation(summary = "Restore a deleted member")
    public ResponseEntity<MemberResponse> restore(@PathVariable UUID memberId) {
        StaffPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(MemberResponse.from(memberService.restore(principal.gymId(), principal.staffId(), memberId)));
    }
}

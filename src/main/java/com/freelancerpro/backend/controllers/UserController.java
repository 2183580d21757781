package com.freelancerpro.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.freelancerpro.backend.dto.ApiResponse;
import com.freelancerpro.backend.dto.user.UserProfileDTO;
import com.freelancerpro.backend.security.CurrentUserService;
import com.freelancerpro.backend.services.UserService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final CurrentUserService currentUserService;

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<UserProfileDTO>> me() {
        UserProfileDTO profile = userService.getProfile(currentUserService.requireCurrentUserId());
        return ResponseEntity.ok(ApiResponse.success(profile, "Profile retrieved successfully"));
    }
}

package com.example.dcim.access.model;

public record TokenPair(IssuedToken accessToken, IssuedToken refreshToken) {}

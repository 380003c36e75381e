// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Validator identities and the signed content exchanged during a round. Every signed type writes a canonical byte
/// form with [com.github.batch_auction.types.Canonical] and compares by the digest of those bytes.
package com.github.batch_auction.types;

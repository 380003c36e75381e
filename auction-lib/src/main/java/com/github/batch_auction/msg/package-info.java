// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The messages validators exchange during a round. Transport and wire encoding belong to the host.
///
/// ```
/// AuctionMessage
/// ├── SignedMessage
/// │   ├── PrePropose
/// │   ├── PreProposeAggregation
/// │   ├── Propose
/// │   └── Commit
/// └── RelaySubmission
///```
///
/// Every `SignedMessage` is verified against the roster, dropped if seen before and otherwise relayed once.
package com.github.batch_auction.msg;

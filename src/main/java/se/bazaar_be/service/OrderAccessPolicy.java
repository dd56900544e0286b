package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.exception.AccessDeniedException;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.pojo.Seller;
import se.bazaar_be.pojo.enums.Role;
import se.bazaar_be.repository.SellerRepository;

/**
 * Relationship checks between the calling actor and an order. Buyers act on their own orders,
 * sellers on orders placed with them, admins on any order.
 */
@Component
@RequiredArgsConstructor
public class OrderAccessPolicy {

    private final SellerRepository sellerRepository;

    public void requireCustomer(Actor actor) {
        if (actor.getRole() != Role.CUSTOMER) {
            throw new AccessDeniedException("Only customers can perform this action");
        }
    }

    public void requireBuyer(Order order, Actor actor) {
        requireCustomer(actor);
        if (!order.getBuyerId().equals(actor.getUserId())) {
            throw new AccessDeniedException("Order " + order.getOrderNumber() + " does not belong to this customer");
        }
    }

    public Seller requireSellerAccount(Actor actor) {
        if (actor.getRole() != Role.SELLER) {
            throw new AccessDeniedException("Only sellers can perform this action");
        }
        return sellerRepository.findByUserId(actor.getUserId())
                .orElseThrow(() -> new AccessDeniedException("No seller profile for user " + actor.getUserId()));
    }

    public Seller requireSeller(Order order, Actor actor) {
        Seller seller = requireSellerAccount(actor);
        if (!seller.getSellerId().equals(order.getSellerId())) {
            throw new AccessDeniedException("Order " + order.getOrderNumber() + " was not placed with this seller");
        }
        return seller;
    }

    public void requireAdmin(Actor actor) {
        if (!actor.isAdmin()) {
            throw new AccessDeniedException("Admin role required");
        }
    }

    public void requireCanView(Order order, Actor actor) {
        switch (actor.getRole()) {
            case ADMIN, SYSTEM -> {
            }
            case CUSTOMER -> requireBuyer(order, actor);
            case SELLER -> requireSeller(order, actor);
        }
    }
}
